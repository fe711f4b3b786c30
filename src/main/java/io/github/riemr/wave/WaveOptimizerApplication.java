package io.github.riemr.wave;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaveOptimizerApplication {

	public static void main(String[] args) {
		SpringApplication.run(WaveOptimizerApplication.class, args);
	}

}
