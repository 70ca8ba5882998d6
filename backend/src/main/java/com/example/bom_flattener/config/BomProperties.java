package com.example.bom_flattener.config;

import com.example.bom_flattener.entity.enumclass.BomView;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * BOM 처리 설정 ({@code app.bom.*}).
 */
@Validated
@ConfigurationProperties(prefix = "app.bom")
public class BomProperties {

    /**
     * 부품 마스터로 사용할 시트 이름 (대소문자 무시).
     * <p>
     * 해당 이름의 시트가 없으면 첫 번째 시트를 부품 마스터로 사용한다.
     */
    @NotBlank
    private String partsSheetName = "Parts list";

    /**
     * 뷰를 지정하지 않은 요청에 사용할 기본 뷰.
     */
    @NotNull
    private BomView defaultView = BomView.TREE;

    public String getPartsSheetName() {
        return partsSheetName;
    }

    public void setPartsSheetName(String partsSheetName) {
        this.partsSheetName = partsSheetName;
    }

    public BomView getDefaultView() {
        return defaultView;
    }

    public void setDefaultView(BomView defaultView) {
        this.defaultView = defaultView;
    }
}
