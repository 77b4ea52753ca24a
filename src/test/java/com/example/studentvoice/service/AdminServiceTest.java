package com.example.studentvoice.service;

import com.example.studentvoice.config.AdminProperties;
import com.example.studentvoice.model.Admin;
import com.example.studentvoice.model.Tweet;
import com.example.studentvoice.repository.AdminRepository;
import com.example.studentvoice.repository.TweetRepository;
import com.example.studentvoice.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AdminServiceTest extends IntegrationTestSupport {

    @Autowired
    private AdminService adminService;

    @Autowired
    private AdminRepository adminRepository;

    @Autowired
    private TweetService tweetService;

    @Autowired
    private TweetRepository tweetRepository;

    @Test
    @DisplayName("Главный админ создается один раз из настроек приложения")
    void ensureAdminExists_twice_insertsOnce() {
        Admin first = adminService.ensureAdminExists();
        Admin second = adminService.ensureAdminExists();

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(countRows("admins")).isEqualTo(1);
        assertThat(first.getTelegramChatId()).isEqualTo(555000111L);
        assertThat(first.getEmail()).isEqualTo("admin@example.com");
        assertThat(first.getPhoneNumber()).isEqualTo(989120000000L);
        assertThat(first.getUsername()).isEqualTo("sedayedaneshjoolu_admin");
        assertThat(first.getRole()).isEqualTo("admin");
        assertThat(first.getExpiration()).isEqualTo(LocalDateTime.of(2024, 5, 26, 0, 0));
    }

    @Test
    @DisplayName("Переданные настройки используются при создании, но не меняют существующего админа")
    void getOrCreateSingletonAdmin_usesSuppliedSettings() {
        AdminProperties settings = new AdminProperties();
        settings.setTelegramChatId(42L);
        settings.setEmail("ops@example.com");
        settings.setPhoneNumber(123L);
        settings.setUsername("ops");

        Admin created = adminService.getOrCreateSingletonAdmin(settings);

        AdminProperties other = new AdminProperties();
        other.setTelegramChatId(43L);
        Admin existing = adminService.ensureAdminExists(other);

        assertThat(created.getTelegramChatId()).isEqualTo(42L);
        assertThat(created.getUsername()).isEqualTo("ops");
        assertThat(created.getRole()).isEqualTo("admin");
        assertThat(existing.getId()).isEqualTo(created.getId());
        assertThat(existing.getTelegramChatId()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Параллельные вызовы ensureAdminExists создают одного главного админа")
    void ensureAdminExists_concurrentCalls_insertOnce() throws Exception {
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Admin>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return adminService.ensureAdminExists();
                }));
            }
            start.countDown();

            Long expectedId = null;
            for (Future<Admin> future : futures) {
                Admin admin = future.get(10, TimeUnit.SECONDS);
                if (expectedId == null) {
                    expectedId = admin.getId();
                }
                assertThat(admin.getId()).isEqualTo(expectedId);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(countRows("admins")).isEqualTo(1);
    }

    @Test
    @DisplayName("createAdmin каждый раз добавляет нового админа без singleton_key")
    void createAdmin_insertsUnconditionally() {
        Admin first = adminService.createAdmin(newAdmin("helper"));
        Admin second = adminService.createAdmin(newAdmin("helper"));

        assertThat(second.getId()).isGreaterThan(first.getId());
        assertThat(first.getSingletonKey()).isNull();
        assertThat(second.getSingletonKey()).isNull();
        assertThat(first.getRole()).isEqualTo("admin");
        assertThat(countRows("admins")).isEqualTo(2);
        assertThat(adminRepository.findBySingletonKey(Admin.SINGLETON_KEY)).isEmpty();
    }

    @Test
    @DisplayName("Среди одноименных админов возвращается с меньшим id")
    void getByUsername_duplicates_returnsLowestId() {
        Admin first = adminService.createAdmin(newAdmin("helper"));
        adminService.createAdmin(newAdmin("helper"));

        assertThat(adminService.getByUsername("helper")).get()
            .extracting(Admin::getId).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("Поиск админа по username")
    void getByUsername_findsAdmin() {
        adminService.ensureAdminExists();

        assertThat(adminService.getByUsername("sedayedaneshjoolu_admin")).isPresent();
        assertThat(adminService.getByUsername("missing")).isEmpty();
    }

    @Test
    @DisplayName("Удаляется админ с максимальным id")
    void removeHighestId_deletesNewestAdmin() {
        Admin primary = adminService.ensureAdminExists();
        Admin extra = adminService.createAdmin(newAdmin("helper"));

        adminService.removeHighestId();

        assertThat(adminRepository.findById(extra.getId())).isEmpty();
        assertThat(adminRepository.findById(primary.getId())).isPresent();
    }

    @Test
    @DisplayName("Удаление без админов ничего не делает")
    void removeHighestId_noAdmins_isNoop() {
        adminService.removeHighestId();

        assertThat(countRows("admins")).isZero();
    }

    @Test
    @DisplayName("Посты удаленного админа остаются без ссылки на него")
    void removeHighestId_detachesAdminTweets() {
        Admin admin = adminService.ensureAdminExists();
        Tweet tweet = tweetService.create(1L, "admin", "A", "D", "announcement", "now", null, admin.getId());

        adminService.removeHighestId();

        assertThat(tweetRepository.findById(tweet.getId())).get()
            .extracting(Tweet::getAdminId).isNull();
    }

    @Test
    @DisplayName("deleteSingletonAdmin удаляет только главного админа")
    void deleteSingletonAdmin_keepsOtherAdmins() {
        adminService.ensureAdminExists();
        Admin extra = adminService.createAdmin(newAdmin("helper"));

        adminService.deleteSingletonAdmin();

        assertThat(adminRepository.findBySingletonKey(Admin.SINGLETON_KEY)).isEmpty();
        assertThat(adminRepository.findById(extra.getId())).isPresent();
    }

    private AdminProperties newAdmin(String username) {
        AdminProperties settings = new AdminProperties();
        settings.setUsername(username);
        return settings;
    }
}
