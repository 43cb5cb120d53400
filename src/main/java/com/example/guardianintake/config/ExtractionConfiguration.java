package com.example.guardianintake.config;

import com.example.guardianintake.dto.rules.ExtractionRules;
import com.example.guardianintake.service.extraction.CorrectionRuleApplier;
import com.example.guardianintake.service.extraction.CourtOrderParser;
import com.example.guardianintake.service.extraction.DualSubjectSplitter;
import com.example.guardianintake.service.extraction.FieldExtractor;
import com.example.guardianintake.service.extraction.FieldSpecs;
import com.example.guardianintake.service.extraction.FuzzyAnchorMatcher;
import com.example.guardianintake.service.extraction.IntakeFormParser;
import com.example.guardianintake.service.extraction.SectionSegmenter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The extraction components are plain classes; this wires them from the loaded rules
 * and the intake properties.
 */
@Configuration
public class ExtractionConfiguration {

    @Autowired
    private IntakeProperties intakeProperties;

    @Bean
    public FuzzyAnchorMatcher fuzzyAnchorMatcher() {
        return new FuzzyAnchorMatcher(intakeProperties.getAnchor().getMaxEditRatio(),
            intakeProperties.getAnchor().getScoreFloor());
    }

    @Bean
    public CorrectionRuleApplier correctionRuleApplier(ExtractionRules rules) {
        return new CorrectionRuleApplier(rules);
    }

    @Bean
    public SectionSegmenter sectionSegmenter(ExtractionRules rules, FuzzyAnchorMatcher matcher) {
        return new SectionSegmenter(rules, matcher);
    }

    @Bean
    public FieldExtractor fieldExtractor(CorrectionRuleApplier corrections) {
        return new FieldExtractor(corrections, FieldSpecs.ALL,
            intakeProperties.getExtraction().getSurnameMaxEditDistance());
    }

    @Bean
    public DualSubjectSplitter dualSubjectSplitter(ExtractionRules rules) {
        return new DualSubjectSplitter(rules.getSeparators());
    }

    @Bean
    public IntakeFormParser intakeFormParser(CorrectionRuleApplier corrections, SectionSegmenter segmenter,
                                             FieldExtractor extractor, DualSubjectSplitter splitter,
                                             ExtractionRules rules) {
        return new IntakeFormParser(corrections, segmenter, extractor, splitter, rules);
    }

    @Bean
    public CourtOrderParser courtOrderParser(CorrectionRuleApplier corrections, SectionSegmenter segmenter,
                                             FieldExtractor extractor) {
        return new CourtOrderParser(corrections, segmenter, extractor);
    }
}
