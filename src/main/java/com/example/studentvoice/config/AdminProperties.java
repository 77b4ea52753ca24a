package com.example.studentvoice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Данные главного админа и настройки ежемесячной проверки срока.
 * Передаются в {@code AdminService.ensureAdminExists} явно, значения не зашиты в сущность.
 */
@ConfigurationProperties(prefix = "app.admin")
@Getter
@Setter
public class AdminProperties {
    private Long telegramChatId;
    private String email;
    private Long phoneNumber;
    private String username = "sedayedaneshjoolu_admin";
    private String role = "admin";
    private LocalDateTime expiration = LocalDateTime.of(2024, 5, 26, 0, 0);

    // В месяцах без этого дня проверка не срабатывает
    private int expiryDayOfMonth = 30;
    // Часовой пояс, в котором считается день месяца и запускается cron проверки
    private ZoneId expiryZone = ZoneId.of("UTC");
    private boolean expiryCheckEnabled = true;
    private String expiryCheckCron = "0 0 0 * * *";
}
