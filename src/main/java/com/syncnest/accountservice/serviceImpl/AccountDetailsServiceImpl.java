package com.syncnest.accountservice.serviceImpl;

import com.syncnest.accountservice.config.CacheConfig;
import com.syncnest.accountservice.repository.AccountRepository;
import com.syncnest.accountservice.utils.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AccountDetailsServiceImpl implements UserDetailsService {

    private final AccountRepository accountRepository;

    @Override
    @Transactional(readOnly = true)
    @Cacheable(
            cacheNames = CacheConfig.ACCOUNT_DETAILS_BY_EMAIL,
            keyGenerator = "lowerCaseStringKeyGenerator",
            sync = true
    )
    public UserDetails loadUserByUsername(String email) throws UsernameNotFoundException {
        if (email == null || email.isBlank()) {
            throw new UsernameNotFoundException("Account not found");
        }
        final String normalized = InputValidator.normalizeEmail(email);
        log.debug("Loading account by email: {}", normalized);

        // unverified and inactive accounts look exactly like missing ones
        return accountRepository.findByEmailAndActiveTrueAndVerifiedTrue(normalized)
                .orElseThrow(() -> new UsernameNotFoundException("Account not found"));
    }
}
