package ru.tigran.freigenthub.repository;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.freigenthub.model.UserProfile;

import java.util.Optional;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, String> {

    @EntityGraph(attributePaths = "experiences")
    Optional<UserProfile> findWithExperiencesByUserId(String userId);
}
