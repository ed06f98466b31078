package app.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AssistantBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(AssistantBackendApplication.class, args);
	}
}
