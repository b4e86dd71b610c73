package com.phillippitts.dictavault;

import com.phillippitts.dictavault.config.properties.ClassifierProperties;
import com.phillippitts.dictavault.config.properties.DetectionProperties;
import com.phillippitts.dictavault.config.properties.VaultProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DetectionProperties.class,
        ClassifierProperties.class,
        VaultProperties.class
})
public class DictaVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(DictaVaultApplication.class, args);
    }

}
