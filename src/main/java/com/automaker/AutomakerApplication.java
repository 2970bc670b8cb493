package com.automaker;

import com.automaker.dispatch.cli.LaunchMode;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class AutomakerApplication {

    public static void main(String[] args) {
        LaunchMode mode = LaunchMode.of(args);

        SpringApplicationBuilder builder = new SpringApplicationBuilder(AutomakerApplication.class)
                .properties("spring.main.banner-mode=off");

        switch (mode) {
            case SERVER -> builder.properties("spring.main.web-application-type=servlet");
            case STATUS_TOOL -> builder
                    .properties("spring.main.web-application-type=none", "spring.main.log-startup-info=false")
                    .profiles(LaunchMode.STATUS_TOOL_PROFILE);
            case COMMAND -> builder.properties("spring.main.web-application-type=none");
        }

        ApplicationContext ctx = builder.run(args);

        if (mode.runsPicocli()) {
            ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
            System.exit(SpringApplication.exit(ctx, exitCodeGen));
        }
    }
}
