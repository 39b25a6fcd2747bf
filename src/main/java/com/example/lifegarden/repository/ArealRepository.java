package com.example.lifegarden.repository;

import com.example.lifegarden.domain.Areal;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ArealRepository extends JpaRepository<Areal, String> {
  List<Areal> findAllByOrderByNameAsc();
}
