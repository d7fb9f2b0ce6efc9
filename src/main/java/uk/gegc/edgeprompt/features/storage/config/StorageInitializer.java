package uk.gegc.edgeprompt.features.storage.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import uk.gegc.edgeprompt.features.storage.application.MaterialStorageService;

/**
 * Creates the storage tree on start-up.
 */
@Component
@RequiredArgsConstructor
public class StorageInitializer implements CommandLineRunner {

    private final MaterialStorageService storageService;

    @Override
    public void run(String... args) {
        storageService.initialize();
    }
}
