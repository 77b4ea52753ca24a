package com.example.studentvoice.service;

import com.example.studentvoice.model.Student;
import com.example.studentvoice.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class StudentService {

    private final StudentRepository studentRepository;
    private final Clock clock;

    /**
     * Регистрирует студента по chat_id или возвращает уже существующего.
     * Существующая запись не обновляется, даже если имя или username изменились.
     */
    public Student createOrGet(String username, Long chatId, String firstName, String lastName) {
        Optional<Student> existing = studentRepository.findByChatId(chatId);
        if (existing.isPresent()) {
            log.debug("Студент с chatId {} уже зарегистрирован (id: {})", chatId, existing.get().getId());
            return existing.get();
        }

        Student student = new Student();
        student.setUsername(username);
        student.setChatId(chatId);
        student.setFirstName(firstName);
        student.setLastName(lastName);
        student.setLoginTime(LocalDateTime.now(clock));

        try {
            Student saved = studentRepository.saveAndFlush(student);
            log.info("Зарегистрирован новый студент {} (chatId: {}, id: {})", username, chatId, saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // Параллельная регистрация с тем же chat_id: уникальный индекс отклонил вторую вставку
            log.warn("Студент с chatId {} уже создан параллельным запросом, перечитываем", chatId);
            return studentRepository.findByChatId(chatId).orElseThrow(() -> e);
        }
    }

    public Optional<Student> getByChatId(Long chatId) {
        return studentRepository.findByChatId(chatId);
    }

    /**
     * Фиксирует время выхода. Повторный вызов перезаписывает предыдущее значение.
     */
    @Transactional
    public void recordLogout(Student student) {
        student.setLogoutTime(LocalDateTime.now(clock));
        studentRepository.save(student);
        log.info("Студент {} вышел (chatId: {})", student.getUsername(), student.getChatId());
    }
}
