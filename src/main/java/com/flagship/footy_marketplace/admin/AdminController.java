package com.flagship.footy_marketplace.admin;

import com.flagship.footy_marketplace.admin.dto.RevenueResponse;
import com.flagship.footy_marketplace.admin.dto.VoidInvoiceRequest;
import com.flagship.footy_marketplace.placement.dto.InvoiceResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final AdminService adminService;

    @PostMapping("/invoices/{invoiceId}/mark-paid")
    public InvoiceResponse markPaid(@PathVariable("invoiceId") UUID invoiceId) {
        return InvoiceResponse.from(adminService.markInvoicePaid(invoiceId));
    }

    @PostMapping("/invoices/{invoiceId}/void")
    public InvoiceResponse voidInvoice(@PathVariable("invoiceId") UUID invoiceId,
                                       @Valid @RequestBody VoidInvoiceRequest request) {
        return InvoiceResponse.from(adminService.voidInvoice(invoiceId, request.getReason()));
    }

    @GetMapping("/invoices/unpaid")
    public List<InvoiceResponse> unpaid() {
        return adminService.unpaidInvoices().stream().map(InvoiceResponse::from).toList();
    }

    @PostMapping("/memberships/expire")
    public Map<String, Integer> expire() {
        return Map.of("expired", adminService.runExpirySweep());
    }

    @GetMapping("/revenue")
    public RevenueResponse revenue() {
        return RevenueResponse.from(adminService.revenue());
    }
}
