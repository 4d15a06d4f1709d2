package com.siteplatform.materials.api.v2;

import com.siteplatform.common.dispatch.CodecBackedResource;
import com.siteplatform.common.version.ApiVersion;
import com.siteplatform.materials.model.Material;
import com.siteplatform.materials.service.MaterialService;
import org.springframework.stereotype.Component;

@Component
public class MaterialV2Resource extends CodecBackedResource<Material, MaterialV2Dto> {

  public static final String RESOURCE = "materials";
  public static final ApiVersion VERSION = new ApiVersion(2, 0);

  public MaterialV2Resource(MaterialV2Codec codec, MaterialService materialService) {
    super(RESOURCE, VERSION, MaterialV2Dto.class, codec, materialService);
  }
}
