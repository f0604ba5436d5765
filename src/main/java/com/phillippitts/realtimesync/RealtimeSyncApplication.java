package com.phillippitts.realtimesync;

import com.phillippitts.realtimesync.config.properties.RealtimeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RealtimeProperties.class
})
public class RealtimeSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeSyncApplication.class, args);
    }

}
