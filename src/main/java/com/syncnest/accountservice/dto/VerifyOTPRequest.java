package com.syncnest.accountservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Width of the code is checked by the service against the configured digit count. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerifyOTPRequest {

    @NotBlank(message = "Invalid email format")
    @Email(message = "Invalid email format")
    private String email;

    @NotBlank(message = "Otp must contain only digits")
    @Pattern(regexp = "\\d+", message = "Otp must contain only digits")
    private String otp;
}
