package com.anxietycompanion.repository;

import com.anxietycompanion.model.entity.AnxietyAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface AnxietyAnalysisRepository extends JpaRepository<AnxietyAnalysis, UUID> {
    List<AnxietyAnalysis> findByMessageIdIn(Collection<UUID> messageIds);
}
