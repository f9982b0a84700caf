package com.tony.gridironAnalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GridironAnalyticsApplication {

	public static void main(String[] args) {
		SpringApplication.run(GridironAnalyticsApplication.class, args);
	}

}
