package com.anagramgame.phrases.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayerProfile {
    private UUID id;
    private String name;
    private int totalScore;
}
