package com.yourapp.tracker.habit_tracker.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * One logged occurrence of a habit. The habit is referenced by id only; the
 * foreign key and its ON DELETE CASCADE live in the schema.
 */
@Entity
@Table(name = "records",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_records_habit_date",
                columnNames = {"habit_id", "record_date"}
        ))
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString
public class HabitRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "habit_id", nullable = false)
    private Long habitId;

    @Column(name = "record_date", nullable = false)
    private LocalDate date;

    public HabitRecord(Long habitId, LocalDate date) {
        this.habitId = habitId;
        this.date = date;
    }

    public HabitRecord copy() {
        HabitRecord copy = new HabitRecord(habitId, date);
        copy.setId(id);
        return copy;
    }
}
