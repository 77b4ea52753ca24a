package com.example.studentvoice.service;

import com.example.studentvoice.model.Tweet;
import com.example.studentvoice.repository.TweetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TweetService {

    private final TweetRepository tweetRepository;

    /**
     * Сохраняет пост без проверки на дубликаты.
     * Несуществующий studentId или adminId отклоняется внешним ключом.
     */
    @Transactional
    public Tweet create(Long chatId, String username, String firstName, String lastName,
                        String content, String postageDate, Long studentId, Long adminId) {
        Tweet tweet = new Tweet();
        tweet.setChatId(chatId);
        tweet.setUsername(username);
        tweet.setFirstName(firstName);
        tweet.setLastName(lastName);
        tweet.setContent(content);
        tweet.setPostageDate(postageDate);
        tweet.setStudentId(studentId);
        tweet.setAdminId(adminId);

        Tweet saved = tweetRepository.save(tweet);
        log.info("Сохранен пост {} от chatId {}", saved.getId(), chatId);
        return saved;
    }

    public Tweet create(Long chatId, String username, String firstName, String lastName,
                        String content, String postageDate) {
        return create(chatId, username, firstName, lastName, content, postageDate, null, null);
    }

    public List<Tweet> findByUser(Long chatId, String username, String firstName, String lastName) {
        List<Tweet> tweets = tweetRepository
            .findByChatIdAndUsernameAndFirstNameAndLastNameOrderByIdAsc(chatId, username, firstName, lastName);
        log.debug("Найдено {} постов для chatId {}", tweets.size(), chatId);
        return tweets;
    }

    /**
     * Последний созданный пост (максимальный id)
     */
    public Optional<Tweet> getLatest() {
        return tweetRepository.findFirstByOrderByIdDesc();
    }
}
