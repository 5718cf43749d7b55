package com.pairtrader.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PairTraderApplication {
	public static void main(String[] args) {
		SpringApplication.run(PairTraderApplication.class, args);
	}
}
