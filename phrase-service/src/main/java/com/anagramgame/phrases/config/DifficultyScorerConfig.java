package com.anagramgame.phrases.config;

import com.anagramgame.difficulty.DifficultyScorer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DifficultyScorerConfig {

    @Bean
    public DifficultyScorer difficultyScorer() {
        return new DifficultyScorer();
    }
}
