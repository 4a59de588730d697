package ru.uzden.vpnpanel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import ru.uzden.vpnpanel.config.PanelProperties;

@SpringBootApplication
@EntityScan("ru.uzden.vpnpanel.entities")
@EnableConfigurationProperties(PanelProperties.class)
@EnableScheduling
public class VpnPanelApplication {
    public static void main(String[] args) {
        SpringApplication.run(VpnPanelApplication.class, args);
    }
}
