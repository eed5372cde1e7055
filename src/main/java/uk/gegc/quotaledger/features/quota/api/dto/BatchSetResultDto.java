package uk.gegc.quotaledger.features.quota.api.dto;

import java.util.List;

public record BatchSetResultDto(
        int success,
        int failed,
        List<Detail> details
) {
    public record Detail(String username, boolean success, Long balance, String error) {

        public static Detail ok(String username, long balance) {
            return new Detail(username, true, balance, null);
        }

        public static Detail failed(String username, String error) {
            return new Detail(username, false, null, error);
        }
    }
}
