package com.example.studentvoice.repository;

import com.example.studentvoice.model.Admin;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AdminRepository extends JpaRepository<Admin, Long> {
    Optional<Admin> findBySingletonKey(String singletonKey);
    Optional<Admin> findFirstByUsernameOrderByIdAsc(String username);
    Optional<Admin> findFirstByOrderByIdDesc();
}
