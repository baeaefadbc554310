package ru.tigran.freigenthub.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored user profile, one per user id.
 * A profile is what makes a registered agent eligible as a peer in multi-agent search.
 */
@Entity
@Table(name = "profiles")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "userId", callSuper = false)
@ToString(exclude = "experiences")
public class UserProfile extends AuditableEntity {

    @Id
    @Column(name = "user_id", length = 128)
    private String userId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String personality;

    // "values" is reserved in SQL
    @Column(name = "values_text", nullable = false, columnDefinition = "TEXT")
    private String valuesText;

    @OneToMany(mappedBy = "profile", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ProductExperience> experiences = new ArrayList<>();

    public UserProfile(String userId) {
        this.userId = userId;
    }

    /**
     * Replaces all experiences of this profile.
     */
    public void replaceExperiences(List<ProductExperience> newExperiences) {
        experiences.clear();
        for (ProductExperience experience : newExperiences) {
            experience.setProfile(this);
            experiences.add(experience);
        }
    }
}
