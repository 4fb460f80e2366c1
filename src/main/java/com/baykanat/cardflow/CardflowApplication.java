package com.baykanat.cardflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Uygulama giriş noktası; @EnableScheduling ile entropy ve bundle taramaları. */
@SpringBootApplication
@EnableScheduling
public class CardflowApplication {

	public static void main(String[] args) {
		SpringApplication.run(CardflowApplication.class, args);
	}

}
