package com.example.studentvoice.repository;

import com.example.studentvoice.model.Tweet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TweetRepository extends JpaRepository<Tweet, Long> {

    /**
     * Точное совпадение по всем четырём полям. username = null совпадает только с null.
     */
    List<Tweet> findByChatIdAndUsernameAndFirstNameAndLastNameOrderByIdAsc(Long chatId, String username,
                                                                           String firstName, String lastName);

    Optional<Tweet> findFirstByOrderByIdDesc();
}
