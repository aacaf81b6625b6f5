package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class EligibilityCheckEntity {

    private boolean valid;
    private List<String> errors;

}
