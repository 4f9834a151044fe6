package uk.gegc.tunetrivia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TuneTriviaApplication {

    public static void main(String[] args) {
        SpringApplication.run(TuneTriviaApplication.class, args);
    }
}
