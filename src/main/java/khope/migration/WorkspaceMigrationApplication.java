package khope.migration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class WorkspaceMigrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkspaceMigrationApplication.class, args);
    }
}
