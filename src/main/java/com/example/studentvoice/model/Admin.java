package com.example.studentvoice.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "admins")
public class Admin {
    public static final String SINGLETON_KEY = "primary";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /**
     * Ключ единственного "главного" админа. У остальных строк null.
     */
    @Size(max = 32)
    @Column(name = "singleton_key", unique = true, length = 32)
    private String singletonKey;

    @Column(name = "telegram_chat_id")
    private Long telegramChatId;

    @NotNull
    @Size(max = 100)
    @Column(name = "username", nullable = false, length = 100)
    private String username;

    @Size(max = 255)
    @Column(name = "email")
    private String email;

    @NotNull
    @Size(max = 50)
    @Column(name = "role", nullable = false, length = 50)
    private String role;

    @Column(name = "expiration")
    private LocalDateTime expiration;

    @Column(name = "phone_number")
    private Long phoneNumber;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @OneToMany(mappedBy = "admin")
    private List<Tweet> tweets = new ArrayList<>();

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @OneToMany(mappedBy = "admin")
    private List<ApprovedRequest> approvedRequests = new ArrayList<>();
}
