package com.di.suitesplit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SuiteSplitApplication {

	public static void main(String[] args) {
		SpringApplication.run(SuiteSplitApplication.class, args);
	}
}
