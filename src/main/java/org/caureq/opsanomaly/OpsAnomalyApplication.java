package org.caureq.opsanomaly;

import org.caureq.opsanomaly.config.AdminProps;
import org.caureq.opsanomaly.config.AppProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProps.class, AdminProps.class})
public class OpsAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsAnomalyApplication.class, args);
    }

}
