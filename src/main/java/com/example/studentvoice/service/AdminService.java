package com.example.studentvoice.service;

import com.example.studentvoice.config.AdminProperties;
import com.example.studentvoice.model.Admin;
import com.example.studentvoice.repository.AdminRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final AdminRepository adminRepository;
    private final AdminProperties adminProperties;
    private final Clock clock;

    /**
     * Возвращает главного админа, создавая его из настроек приложения при первом вызове
     */
    public Admin ensureAdminExists() {
        return getOrCreateSingletonAdmin(adminProperties);
    }

    public Admin ensureAdminExists(AdminProperties settings) {
        return getOrCreateSingletonAdmin(settings);
    }

    /**
     * Возвращает главного админа или создает его из переданных настроек.
     * Уже существующая запись не обновляется. Гонку двух одновременных вызовов
     * разрешает уникальный индекс на singleton_key.
     */
    public Admin getOrCreateSingletonAdmin(AdminProperties settings) {
        Optional<Admin> existing = adminRepository.findBySingletonKey(Admin.SINGLETON_KEY);
        if (existing.isPresent()) {
            return existing.get();
        }

        Admin admin = fromSettings(settings);
        admin.setSingletonKey(Admin.SINGLETON_KEY);

        try {
            Admin saved = adminRepository.saveAndFlush(admin);
            log.info("Создан главный админ {} (id: {})", saved.getUsername(), saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Главный админ уже создан параллельным запросом, перечитываем");
            return adminRepository.findBySingletonKey(Admin.SINGLETON_KEY).orElseThrow(() -> e);
        }
    }

    /**
     * Добавляет обычного админа (без singleton_key) из переданных настроек, без проверки на дубликаты
     */
    @Transactional
    public Admin createAdmin(AdminProperties settings) {
        Admin saved = adminRepository.save(fromSettings(settings));
        log.info("Добавлен админ {} (id: {})", saved.getUsername(), saved.getId());
        return saved;
    }

    public Optional<Admin> getByUsername(String username) {
        return adminRepository.findFirstByUsernameOrderByIdAsc(username);
    }

    /**
     * Ежемесячная проверка: в заданный день месяца (по умолчанию 30) удаляет админа с максимальным id.
     * В месяцах без этого дня (февраль) удаления не происходит.
     *
     * @return true, если сегодня день проверки и удаление выполнялось
     */
    @Transactional
    public boolean runMonthlyExpiryCheck() {
        LocalDate today = LocalDate.now(clock.withZone(adminProperties.getExpiryZone()));
        if (today.getDayOfMonth() != adminProperties.getExpiryDayOfMonth()) {
            log.debug("Проверка срока админа пропущена: сегодня {}", today);
            return false;
        }
        log.info("День проверки срока админа ({}), удаляем последнего админа", today);
        removeHighestId();
        return true;
    }

    @Transactional
    public void removeHighestId() {
        adminRepository.findFirstByOrderByIdDesc().ifPresentOrElse(admin -> {
            adminRepository.delete(admin);
            log.info("Удален админ {} (id: {})", admin.getUsername(), admin.getId());
        }, () -> log.debug("Нет админов для удаления"));
    }

    @Transactional
    public void deleteSingletonAdmin() {
        adminRepository.findBySingletonKey(Admin.SINGLETON_KEY).ifPresent(admin -> {
            adminRepository.delete(admin);
            log.info("Удален главный админ {} (id: {})", admin.getUsername(), admin.getId());
        });
    }

    private Admin fromSettings(AdminProperties settings) {
        Admin admin = new Admin();
        admin.setTelegramChatId(settings.getTelegramChatId());
        admin.setUsername(settings.getUsername());
        admin.setEmail(settings.getEmail());
        admin.setPhoneNumber(settings.getPhoneNumber());
        admin.setRole(settings.getRole());
        admin.setExpiration(settings.getExpiration());
        return admin;
    }
}
