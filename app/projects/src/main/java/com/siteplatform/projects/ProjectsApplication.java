/*
 * どこで: Projects ホストのエントリポイント
 * 何を: Spring Boot の起動と共通モジュールの取り込みを行う
 * なぜ: projects リソースを独立プロセスとして公開するため
 */
package com.siteplatform.projects;

import com.siteplatform.common.config.PlatformCommonConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication(scanBasePackages = "com.siteplatform")
@Import(PlatformCommonConfig.class)
@RestController
public class ProjectsApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProjectsApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "projects: ok";
  }
}
