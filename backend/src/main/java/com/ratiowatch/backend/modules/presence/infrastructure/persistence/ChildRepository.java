package com.ratiowatch.backend.modules.presence.infrastructure.persistence;

import java.util.UUID;

import com.ratiowatch.backend.modules.presence.domain.Child;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ChildRepository extends JpaRepository<Child, UUID> {
}
