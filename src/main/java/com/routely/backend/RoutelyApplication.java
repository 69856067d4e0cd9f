package com.routely.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoutelyApplication {

	public static void main(String[] args) {
		SpringApplication.run(RoutelyApplication.class, args);
	}

}
