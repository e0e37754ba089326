package com.dev.sacudo;

import com.dev.sacudo.config.ExecutorProperties;
import com.dev.sacudo.config.ExtractorProperties;
import com.dev.sacudo.config.PlaybackProperties;
import com.dev.sacudo.config.ResolverProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
		PlaybackProperties.class,
		ResolverProperties.class,
		ExtractorProperties.class,
		ExecutorProperties.class
})
public class SacudoApplication {

	public static void main(String[] args) {
		SpringApplication.run(SacudoApplication.class, args);
	}

}
