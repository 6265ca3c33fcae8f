// Namespace
package com.gnovoa.gridiron;

// Imports
import com.gnovoa.gridiron.catalog.SimProperties;
import com.gnovoa.gridiron.runner.RunnerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties({SimProperties.class, RunnerProperties.class})
public class GridironHistoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(GridironHistoryApplication.class, args);
  }
}
