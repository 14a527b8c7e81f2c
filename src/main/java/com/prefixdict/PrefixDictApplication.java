package com.prefixdict;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PrefixDictApplication {

	public static void main(String[] args) {
		SpringApplication.run(PrefixDictApplication.class, args);
	}

}
