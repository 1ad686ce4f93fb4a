package eu.virtualparadox.ewexport.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "ewexport")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path mappings;
    private Path output;

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (mappings != null) {
            Path mappingsDir = mappings.getParent();
            if (mappingsDir != null) Files.createDirectories(mappingsDir);
        }
    }
}
