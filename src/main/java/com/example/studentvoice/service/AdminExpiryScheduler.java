package com.example.studentvoice.service;

import com.example.studentvoice.config.AdminProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminExpiryScheduler {

    private final AdminService adminService;
    private final AdminProperties adminProperties;

    /**
     * Запускается каждый день в полночь по app.admin.expiry-zone
     */
    @Scheduled(cron = "${app.admin.expiry-check-cron:0 0 0 * * *}", zone = "${app.admin.expiry-zone:UTC}")
    public void checkAdminExpiry() {
        if (!adminProperties.isExpiryCheckEnabled()) {
            log.debug("Проверка срока админа отключена");
            return;
        }

        try {
            adminService.runMonthlyExpiryCheck();
        } catch (DataAccessException e) {
            log.error("Ошибка при ежемесячной проверке срока админа", e);
        }
    }
}
