package com.example.studentvoice.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Пост пользователя. Может принадлежать студенту, админу, обоим сразу или никому.
 * После создания не изменяется.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "tweets")
public class Tweet {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @NotNull
    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Size(max = 50)
    @Column(name = "username", length = 50)
    private String username;

    @NotNull
    @Size(max = 200)
    @Column(name = "first_name", nullable = false, length = 200)
    private String firstName;

    @NotNull
    @Size(max = 200)
    @Column(name = "last_name", nullable = false, length = 200)
    private String lastName;

    @NotNull
    @Size(max = 200)
    @Column(name = "content", nullable = false, length = 200)
    private String content;

    @NotNull
    @Size(max = 100)
    @Column(name = "postage_date", nullable = false, length = 100)
    private String postageDate;  // свободный текст, как его прислал бот

    @Column(name = "student_id")
    private Long studentId;

    @Column(name = "admin_id")
    private Long adminId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id", insertable = false, updatable = false)
    private Student student;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "admin_id", insertable = false, updatable = false)
    private Admin admin;
}
