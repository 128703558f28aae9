package org.twcai.domain.dto.query;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Pagination parameters for listing conversation items.
 *
 * <p>When a page reports {@code has_more}, request the next one with {@code after} set to that page's
 * {@code last_id}. Items come back in ascending order unless {@link ListOrder#DESC} is requested.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"after", "include", "limit", "order"})
public class ListItemsQuery {

    private String after;

    private List<String> include;

    /**
     * 1-100, server default 20.
     */
    private Integer limit;

    private ListOrder order;
}
