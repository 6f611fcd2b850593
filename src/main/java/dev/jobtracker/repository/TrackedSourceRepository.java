package dev.jobtracker.repository;

import dev.jobtracker.entity.TrackedSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TrackedSourceRepository extends JpaRepository<TrackedSource, Long> {

    Optional<TrackedSource> findByUrl(String url);

    boolean existsByUrl(String url);

    List<TrackedSource> findAllByOrderByCreatedAtDescIdDesc();

    List<TrackedSource> findAllByOrderByIdAsc();
}
