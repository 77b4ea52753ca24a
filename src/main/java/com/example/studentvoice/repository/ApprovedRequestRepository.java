package com.example.studentvoice.repository;

import com.example.studentvoice.model.ApprovedRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ApprovedRequestRepository extends JpaRepository<ApprovedRequest, Long> {
}
