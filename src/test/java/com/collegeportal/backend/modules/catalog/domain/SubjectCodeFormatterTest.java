package com.collegeportal.backend.modules.catalog.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SubjectCodeFormatterTest {

    @Test
    @DisplayName("codes are department, semester and a two digit sequence")
    void format() {
        assertThat(SubjectCodeFormatter.format(AcademicDepartment.CS, 1, 1)).isEqualTo("CS101");
        assertThat(SubjectCodeFormatter.format(AcademicDepartment.MECH, 8, 12)).isEqualTo("MECH812");
    }

    @Test
    @DisplayName("sequences past 99 widen the code")
    void formatWidensPastNinetyNine() {
        assertThat(SubjectCodeFormatter.format(AcademicDepartment.CS, 1, 100)).isEqualTo("CS1100");
    }

    @Test
    @DisplayName("invalid semester or sequence is rejected")
    void formatRejectsInvalidInput() {
        assertThatThrownBy(() -> SubjectCodeFormatter.format(AcademicDepartment.CS, 9, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SubjectCodeFormatter.format(AcademicDepartment.CS, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("the sequence is read back from codes of the same department and semester")
    void parseSequence() {
        assertThat(SubjectCodeFormatter.parseSequence("CS103", AcademicDepartment.CS, 1)).hasValue(3);
        assertThat(SubjectCodeFormatter.parseSequence("CS1100", AcademicDepartment.CS, 1)).hasValue(100);
    }

    @Test
    @DisplayName("unreadable codes never throw")
    void parseSequenceIsFailSoft() {
        assertThat(SubjectCodeFormatter.parseSequence(null, AcademicDepartment.CS, 1)).isEmpty();
        assertThat(SubjectCodeFormatter.parseSequence("CS1", AcademicDepartment.CS, 1)).isEmpty();
        assertThat(SubjectCodeFormatter.parseSequence("CS1AB", AcademicDepartment.CS, 1)).isEmpty();
        assertThat(SubjectCodeFormatter.parseSequence("EE101", AcademicDepartment.CS, 1)).isEmpty();
        assertThat(SubjectCodeFormatter.parseSequence("CS199999999999", AcademicDepartment.CS, 1)).isEmpty();
    }

    @Test
    @DisplayName("next sequence starts at 1 and falls back to 1 on garbage")
    void nextSequence() {
        assertThat(SubjectCodeFormatter.nextSequence(null, AcademicDepartment.IT, 2)).isEqualTo(1);
        assertThat(SubjectCodeFormatter.nextSequence("IT207", AcademicDepartment.IT, 2)).isEqualTo(8);
        assertThat(SubjectCodeFormatter.nextSequence("IT2??", AcademicDepartment.IT, 2)).isEqualTo(1);
    }
}
