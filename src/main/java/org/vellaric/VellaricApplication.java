package org.vellaric;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Vellaric Signal 自托管部署平台 - 主启动类
 */
@SpringBootApplication
@MapperScan("org.vellaric.dao.mapper")
public class VellaricApplication {

    public static void main(String[] args) {
        SpringApplication.run(VellaricApplication.class, args);
    }

}
