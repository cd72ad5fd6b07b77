package com.rivaflow.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RivaflowApplication {

	public static void main(String[] args) {
		// Session local times are resolved explicitly per owner zone, so the JVM itself stays on UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(RivaflowApplication.class, args);
	}

}
