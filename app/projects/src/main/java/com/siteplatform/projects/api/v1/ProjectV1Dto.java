package com.siteplatform.projects.api.v1;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** v1 の公開契約。日付・予算・時刻は含まない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProjectV1Dto(Long id, String name, String description, String status) {}
