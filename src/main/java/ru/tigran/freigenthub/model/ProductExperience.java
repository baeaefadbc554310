package ru.tigran.freigenthub.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A product the user has used, with notes and a 0-5 rating.
 */
@Entity
@Table(name = "experiences", indexes = {
    @Index(name = "idx_experience_user", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "profile")
public class ProductExperience {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private UserProfile profile;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String notes;

    @Column(nullable = false)
    private Integer rating;

    public ProductExperience(String name, String notes, Integer rating) {
        this.name = name;
        this.notes = notes;
        this.rating = rating;
    }
}
