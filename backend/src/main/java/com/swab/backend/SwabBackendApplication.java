package com.swab.backend;

import java.util.Map;
import java.util.TimeZone;

import com.swab.backend.global.cli.SwabCommand;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class SwabBackendApplication {

	public static void main(String[] args) {
		// Pin the JVM default timezone so logs and audit timestamps stay in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));

		SwabCommand command = SwabCommand.resolve(args);
		SpringApplication application = new SpringApplication(SwabBackendApplication.class);
		if (command.isOneShot()) {
			application.setWebApplicationType(WebApplicationType.NONE);
			application.setDefaultProperties(Map.of("swab.scheduler.auto-start", "false"));
		}

		ConfigurableApplicationContext context = application.run(args);
		if (command.isOneShot()) {
			System.exit(SpringApplication.exit(context));
		}
	}

}

/*
Must stay in the root package: component scanning starts here, so moving this class into a
sub-package would leave the modules outside of it unregistered.
 */
