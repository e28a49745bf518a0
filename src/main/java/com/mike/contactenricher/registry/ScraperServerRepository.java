package com.mike.contactenricher.registry;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScraperServerRepository extends JpaRepository<ScraperServer, String> {

    List<ScraperServer> findByStatusOrderByServerId(String status);
}
