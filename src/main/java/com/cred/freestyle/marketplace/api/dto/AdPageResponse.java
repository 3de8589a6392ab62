package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.Ad;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * One page of the ranked ad listing.
 *
 * @author Marketplace Team
 */
public class AdPageResponse {

    private List<AdResponse> content;
    private Integer page;
    private Integer size;
    private Long totalElements;
    private Integer totalPages;

    public AdPageResponse() {
    }

    public static AdPageResponse fromPage(Page<Ad> page) {
        AdPageResponse response = new AdPageResponse();
        response.setContent(page.getContent().stream().map(AdResponse::fromEntity).toList());
        response.setPage(page.getNumber());
        response.setSize(page.getSize());
        response.setTotalElements(page.getTotalElements());
        response.setTotalPages(page.getTotalPages());
        return response;
    }

    public List<AdResponse> getContent() {
        return content;
    }

    public void setContent(List<AdResponse> content) {
        this.content = content;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getSize() {
        return size;
    }

    public void setSize(Integer size) {
        this.size = size;
    }

    public Long getTotalElements() {
        return totalElements;
    }

    public void setTotalElements(Long totalElements) {
        this.totalElements = totalElements;
    }

    public Integer getTotalPages() {
        return totalPages;
    }

    public void setTotalPages(Integer totalPages) {
        this.totalPages = totalPages;
    }
}
