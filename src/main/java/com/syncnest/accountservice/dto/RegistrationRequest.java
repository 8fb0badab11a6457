package com.syncnest.accountservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationRequest {

    @NotBlank(message = "Invalid email format")
    @Size(max = 320, message = "Invalid email format")
    @Email(message = "Invalid email format")
    private String email;

    // bcrypt only reads the first 72 bytes
    @NotBlank(message = "Password cannot be empty")
    @Size(min = 8, max = 72, message = "Password length must be between 8 and 72")
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    @ToString.Exclude
    private String password;
}
