package com.switchboard;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;
import java.util.Map;

/**
 * Entry point. {@code serve} starts the servlet gateway; every other command
 * runs in a context without a web server and exits with the command's code.
 */
@SpringBootApplication
public class SwitchboardApplication {

    static final String SERVE_COMMAND = "serve";

    public static void main(String[] args) {
        String[] effectiveArgs = withDefaultCommand(args, System.getenv());
        boolean serve = isServe(effectiveArgs);

        ConfigurableApplicationContext context = new SpringApplicationBuilder(SwitchboardApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .run(effectiveArgs);

        if (!serve) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Platform launchers start the jar without arguments; on Cloud Foundry or
     * Kubernetes that means serve.
     */
    static String[] withDefaultCommand(String[] args, Map<String, String> env) {
        boolean managedPlatform = env.containsKey("VCAP_APPLICATION") || env.containsKey("KUBERNETES_SERVICE_HOST");
        if (args.length == 0 && managedPlatform) {
            return new String[]{SERVE_COMMAND};
        }
        return args;
    }

    public static boolean isServe(String... args) {
        return Arrays.asList(args).contains(SERVE_COMMAND);
    }
}
