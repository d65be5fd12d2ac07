package com.example.rowguard;

import com.example.rowguard.authz.config.AccessControlProperties;
import com.example.rowguard.config.properties.SqlStoreProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AccessControlProperties.class, SqlStoreProperties.class})
public class RowGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(RowGuardApplication.class, args);
    }

}
