package com.phillippitts.dictavault.service.detect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword lists for sensitive topics, keyed by category in evaluation order.
 *
 * <p>Keywords are lowercase; matching is case-insensitive. Multi-word entries ("panic attack")
 * are matched as a single phrase.
 */
final class TopicDictionary {

    static final Map<String, List<String>> TOPICS;

    static {
        Map<String, List<String>> topics = new LinkedHashMap<>();
        topics.put("Medical", List.of(
                "doctor", "hospital", "medication", "prescription", "diagnosis",
                "hemorrhoid", "piles", "ointment", "cream", "suppository",
                "blood", "symptom", "disease", "illness", "surgery", "operation",
                "therapist", "psychiatrist", "counselor", "psychologist",
                "xanax", "antidepressant", "ssri", "prozac", "valium",
                "cancer", "tumor", "biopsy", "scan", "mri", "x-ray"));
        topics.put("Mental Health", List.of(
                "depressed", "depression", "anxiety", "anxious", "panic attack",
                "suicidal", "self-harm", "cutting", "overdose", "breakdown",
                "mental health", "bipolar", "schizophrenia", "ptsd", "trauma",
                "feel low", "feel down", "can't cope", "hopeless", "worthless"));
        topics.put("Financial", List.of(
                "salary", "income", "debt", "loan", "mortgage", "bank account",
                "stock market", "trading", "investment", "portfolio", "shares",
                "tax return", "owe money", "credit score", "bankruptcy",
                "made money", "lost money", "profit", "bonus"));
        topics.put("Embarrassing", List.of(
                "anus", "rectum", "rectal", "bowel", "constipation", "diarrhea",
                "penis", "vagina", "genitals", "erectile", "impotent",
                "std", "herpes", "chlamydia", "gonorrhea", "hiv",
                "vomit", "puke", "shit myself", "wet myself", "incontinence"));
        topics.put("Legal", List.of(
                "arrested", "court case", "lawsuit", "criminal record",
                "police", "prison", "jail", "conviction", "probation",
                "lawyer", "solicitor", "court order", "restraining order"));
        topics.put("Addiction", List.of(
                "alcoholic", "addict", "addiction", "rehab", "withdrawal",
                "cocaine", "heroin", "meth", "overdose", "relapse",
                "aa meeting", "na meeting", "sponsor", "sober", "recovery"));
        TOPICS = Collections.unmodifiableMap(topics);
    }

    private TopicDictionary() {
    }
}
