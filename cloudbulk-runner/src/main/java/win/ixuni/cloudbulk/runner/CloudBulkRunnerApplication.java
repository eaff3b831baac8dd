package win.ixuni.cloudbulk.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import win.ixuni.cloudbulk.runner.config.CloudBulkProperties;

/**
 * CloudBulk command-line application
 * <p>
 * The process exit code is the exit code of the executed command.
 */
@SpringBootApplication
@EnableConfigurationProperties(CloudBulkProperties.class)
public class CloudBulkRunnerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(CloudBulkRunnerApplication.class, args)));
    }
}
