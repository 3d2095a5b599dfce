package app.threejs.catalog.credential;

import org.springframework.boot.ApplicationArguments;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class CredentialConfig {

    @Bean
    public CredentialHolder credentialHolder(CredentialResolver resolver, ApplicationArguments args) {
        Path location = resolver.resolveLocation(args);
        return new CredentialHolder(resolver.resolve(args, location), location);
    }
}
