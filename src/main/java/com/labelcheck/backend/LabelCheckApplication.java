package com.labelcheck.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LabelCheckApplication {

	public static void main(String[] args) {
		SpringApplication.run(LabelCheckApplication.class, args);
	}

}
