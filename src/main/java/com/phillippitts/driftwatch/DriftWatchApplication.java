package com.phillippitts.driftwatch;

import com.phillippitts.driftwatch.config.properties.DetectorProperties;
import com.phillippitts.driftwatch.config.properties.MonitorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        MonitorProperties.class,
        DetectorProperties.class
})
public class DriftWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftWatchApplication.class, args);
    }

}
