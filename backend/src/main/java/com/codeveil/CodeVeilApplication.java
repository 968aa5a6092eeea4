package com.codeveil;

import com.codeveil.interfaces.cli.ObfuscateCommandRunner;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * CodeVeil - Python source obfuscation service and command line tool.
 */
@SpringBootApplication
public class CodeVeilApplication {

	public static void main(String[] args) {
		if (ObfuscateCommandRunner.isCommandLineInvocation(args)) {
			ConfigurableApplicationContext context = new SpringApplicationBuilder(CodeVeilApplication.class)
					.web(WebApplicationType.NONE)
					.bannerMode(Banner.Mode.OFF)
					.properties("logging.level.root=WARN")
					.run(args);
			System.exit(SpringApplication.exit(context));
		}
		SpringApplication.run(CodeVeilApplication.class, args);
	}

}
