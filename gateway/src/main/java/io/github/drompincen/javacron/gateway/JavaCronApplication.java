package io.github.drompincen.javacron.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.javacron")
@EnableMongoRepositories(basePackages = "io.github.drompincen.javacron.persistence.repository")
@EnableScheduling
public class JavaCronApplication {

    public static void main(String[] args) {
        SpringApplication.run(JavaCronApplication.class, args);
    }
}
