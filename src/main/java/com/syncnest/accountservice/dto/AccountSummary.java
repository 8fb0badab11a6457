package com.syncnest.accountservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.syncnest.accountservice.entity.Account;
import lombok.Builder;
import lombok.Data;
import org.springframework.security.core.GrantedAuthority;

import java.util.Set;
import java.util.stream.Collectors;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountSummary {
    private String id;
    private String email;
    private Set<String> roles;
    private boolean emailVerified;

    public static AccountSummary of(Account account) {
        return AccountSummary.builder()
                .id(account.getId() != null ? account.getId().toString() : null)
                .email(account.getEmail())
                .roles(account.getAuthorities().stream()
                        .map(GrantedAuthority::getAuthority)
                        .collect(Collectors.toSet()))
                .emailVerified(account.isVerified())
                .build();
    }
}
