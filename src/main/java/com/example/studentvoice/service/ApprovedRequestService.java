package com.example.studentvoice.service;

import com.example.studentvoice.model.ApprovedRequest;
import com.example.studentvoice.repository.ApprovedRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApprovedRequestService {

    private final ApprovedRequestRepository approvedRequestRepository;

    public ApprovedRequest create(Long chatId, String username, String firstName, String lastName, String content) {
        return create(chatId, username, firstName, lastName, content, null);
    }

    /**
     * Сохраняет одобренную заявку. adminId можно не указывать.
     */
    @Transactional
    public ApprovedRequest create(Long chatId, String username, String firstName, String lastName,
                                  String content, Long adminId) {
        ApprovedRequest request = new ApprovedRequest();
        request.setChatId(chatId);
        request.setUsername(username);
        request.setFirstName(firstName);
        request.setLastName(lastName);
        request.setContent(content);
        request.setAdminId(adminId);

        ApprovedRequest saved = approvedRequestRepository.save(request);
        log.info("Сохранена одобренная заявка {} от {} (chatId: {})", saved.getId(), username, chatId);
        return saved;
    }
}
