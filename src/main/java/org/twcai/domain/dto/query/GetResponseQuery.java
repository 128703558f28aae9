package org.twcai.domain.dto.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"include", "include_obfuscation", "starting_after", "stream"})
public class GetResponseQuery {

    private List<String> include;

    @JsonProperty("include_obfuscation")
    private Boolean includeObfuscation;

    @JsonProperty("starting_after")
    private Integer startingAfter;

    private Boolean stream;
}
