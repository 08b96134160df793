package com.infomedia.abacox.callorchestrator.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Six qualification dimensions plus an overall score, each on a 1-10 scale with 0 meaning unknown.
 * In an analysis result a null field means "no opinion".
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class QualificationStatus {
    private Double overall;
    private Double pain;
    private Double authority;
    private Double need;
    private Double timeline;
    private Double budget;
    private Double fit;

    public static QualificationStatus unknown() {
        return new QualificationStatus(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }

    /**
     * Replaces each dimension for which {@code update} carries a value.
     */
    public void mergeFrom(QualificationStatus update) {
        if (update == null) {
            return;
        }
        if (update.overall != null) overall = update.overall;
        if (update.pain != null) pain = update.pain;
        if (update.authority != null) authority = update.authority;
        if (update.need != null) need = update.need;
        if (update.timeline != null) timeline = update.timeline;
        if (update.budget != null) budget = update.budget;
        if (update.fit != null) fit = update.fit;
    }

    public QualificationStatus copy() {
        return new QualificationStatus(overall, pain, authority, need, timeline, budget, fit);
    }
}
