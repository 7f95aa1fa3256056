package org.gamehost;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * 游戏服务器托管核心 - 主启动类
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@MapperScan("org.gamehost.dao.mapper")
public class GameHostApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameHostApplication.class, args);
    }

}
