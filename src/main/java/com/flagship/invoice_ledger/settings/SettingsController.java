package com.flagship.invoice_ledger.settings;

import com.flagship.invoice_ledger.settings.dto.SettingsRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/settings")
@RequiredArgsConstructor
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping
    public Settings get() {
        return settingsService.getSettings();
    }

    @PutMapping
    public Settings save(@Valid @RequestBody SettingsRequest request) {
        return settingsService.saveSettings(request.toSettings());
    }
}
