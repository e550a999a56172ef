package com.yourapp.tracker.habit_tracker.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "habits")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString
public class Habit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    public Habit(String name) {
        this.name = name;
    }

    /**
     * Detached value copy, so callers never hold the instance the persistence context manages.
     */
    public Habit copy() {
        Habit copy = new Habit(name);
        copy.setId(id);
        return copy;
    }
}
