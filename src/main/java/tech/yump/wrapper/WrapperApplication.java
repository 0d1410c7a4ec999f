package tech.yump.wrapper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.wrapper.config.WrapperProperties;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(WrapperProperties.class)
public class WrapperApplication {

  public static void main(String[] args) {
    SpringApplication.run(WrapperApplication.class, args);
    log.info(">>> Wrapper Application Started <<<");
  }
}
