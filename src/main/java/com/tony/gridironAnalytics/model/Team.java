package com.tony.gridironAnalytics.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "teams")
@Getter @Setter @NoArgsConstructor
public class Team {

    // Abréviation officielle (ex: "KC", "SF"), sert de clé partout dans les plays
    @Id
    @Column(name = "team_abbr", length = 3)
    private String teamAbbr;

    @Column(name = "team_name", nullable = false)
    private String teamName; // Ex: "Kansas City"

    @Column(name = "team_nick")
    private String teamNick; // Ex: "Chiefs"

    private String conference;
    private String division;

    public Team(String teamAbbr, String teamName, String teamNick) {
        this.teamAbbr = teamAbbr;
        this.teamName = teamName;
        this.teamNick = teamNick;
    }

    public String getFullName() {
        return teamNick != null ? teamName + " " + teamNick : teamName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return teamAbbr != null && teamAbbr.equals(((Team) o).getTeamAbbr());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
