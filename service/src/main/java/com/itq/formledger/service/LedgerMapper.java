package com.itq.formledger.service;

import com.itq.formledger.domain.Address;
import com.itq.formledger.dto.AdminRegistryResponse;
import com.itq.formledger.dto.ApprovalDetailsResponse;
import com.itq.formledger.dto.LedgerEventResponse;
import com.itq.formledger.entity.AdminConfig;
import com.itq.formledger.entity.FormApproval;
import com.itq.formledger.entity.LedgerEvent;
import org.springframework.stereotype.Component;

@Component
public class LedgerMapper {

    public ApprovalDetailsResponse toResponse(FormApproval approval) {
        ApprovalDetailsResponse resp = new ApprovalDetailsResponse();
        resp.setDocumentId(approval.getDocumentId());
        resp.setDocumentHash(approval.getDocumentHash().toHex());
        resp.setSigner(approval.getSigner().toHex());
        resp.setApprovedAt(approval.getApprovedAt());
        resp.setMetadata(approval.getMetadata());
        resp.setAddress(approval.getAddress());
        resp.setBump(approval.getBump());
        return resp;
    }

    public AdminRegistryResponse toResponse(AdminConfig config) {
        AdminRegistryResponse resp = new AdminRegistryResponse();
        resp.setAddress(config.getAddress());
        resp.setBump(config.getBump());
        resp.setAuthority(config.getAuthority().toHex());
        resp.setAdmins(config.getAdmins().stream().map(Address::toHex).toList());
        resp.setAdminCount(config.getAdminCount());
        return resp;
    }

    public LedgerEventResponse toResponse(LedgerEvent event) {
        LedgerEventResponse resp = new LedgerEventResponse();
        resp.setId(event.getId());
        resp.setAction(event.getAction());
        resp.setActor(event.getActor().toHex());
        resp.setSubject(event.getSubject());
        resp.setRecordedAt(event.getRecordedAt());
        resp.setDetail(event.getDetail());
        return resp;
    }
}
