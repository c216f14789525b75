package com.showbooking.booking.repository;

import com.showbooking.common.entity.Show;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShowRepository extends JpaRepository<Show, Long> {

    /**
     * Newest shows first
     */
    List<Show> findAllByOrderByCreatedAtDescIdDesc();
}
