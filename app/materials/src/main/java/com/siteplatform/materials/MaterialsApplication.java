/*
 * どこで: Materials ホストのエントリポイント
 * 何を: Spring Boot の起動と共通モジュールの取り込みを行う
 * なぜ: materials リソースを独立プロセスとして公開するため
 */
package com.siteplatform.materials;

import com.siteplatform.common.config.PlatformCommonConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication(scanBasePackages = "com.siteplatform")
@Import(PlatformCommonConfig.class)
@RestController
public class MaterialsApplication {

  public static void main(String[] args) {
    SpringApplication.run(MaterialsApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "materials: ok";
  }
}
