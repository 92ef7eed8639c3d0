package eu.virtualparadox.flockqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlockQaApplication {

    public static void main(final String[] args) {
        SpringApplication.run(FlockQaApplication.class, args);
    }
}
