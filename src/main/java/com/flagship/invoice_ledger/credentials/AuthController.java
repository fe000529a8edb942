package com.flagship.invoice_ledger.credentials;

import com.flagship.invoice_ledger.credentials.dto.ChangePasswordRequest;
import com.flagship.invoice_ledger.credentials.dto.LoginRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Login and password maintenance for the admin panel.
 *
 * A rejected login is 401 with no hint about which field was wrong.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final CredentialService credentialService;

    @PostMapping("/login")
    public ResponseEntity<Map<String, Boolean>> login(@Valid @RequestBody LoginRequest request) {
        boolean accepted = credentialService.authenticate(
            request.getUsername(), request.getPassword(), request.getLicenseKey());
        HttpStatus status = accepted ? HttpStatus.OK : HttpStatus.UNAUTHORIZED;
        return ResponseEntity.status(status).body(Map.of("authenticated", accepted));
    }

    @PostMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        credentialService.changePassword(
            request.getUsername(), request.getCurrentPassword(), request.getLicenseKey(), request.getNewPassword());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/admins")
    public List<AdminAccount> admins() {
        return credentialService.listAdmins();
    }
}
