package com.example.studentvoice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;
import com.example.studentvoice.config.AdminProperties;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AdminProperties.class)
public class StudentVoiceApplication {

	public static void main(String[] args) {
		SpringApplication.run(StudentVoiceApplication.class, args);
	}

}
