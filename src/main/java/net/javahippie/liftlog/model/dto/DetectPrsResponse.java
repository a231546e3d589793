package net.javahippie.liftlog.model.dto;

import java.util.List;

public record DetectPrsResponse(List<PersonalRecordResult> prs, int prCount) {

    public static DetectPrsResponse of(List<PersonalRecordResult> prs) {
        return new DetectPrsResponse(prs, prs.size());
    }
}
