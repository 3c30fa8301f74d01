package org.example.nucleicounter;

import org.example.nucleicounter.cli.CountCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class NucleiCounterApplication {
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(NucleiCounterApplication.class);
        if (CountCommand.isSingleImage(args)) {
            app.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(app.run(args)));
        }
        app.run(args);
    }
}
