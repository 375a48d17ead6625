package com.wabridge.apiwhatsapp.whatsapp;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class TemplateMessageTest {

  private static final ObjectMapper JSON = new ObjectMapper();

  private static JsonNode json(String singleQuoted) throws Exception {
    return JSON.readTree(singleQuoted.replace('\'', '"'));
  }

  @Test
  void header_and_body_are_joined_and_placeholders_replaced() throws Exception {
    JsonNode template =
        json(
            "{'name':'welcome','language':'en','components':["
                + "{'type':'HEADER','text':'Hi {{1}}'},"
                + "{'type':'BODY','text':'Your order {{2}} has shipped. Thanks {{1}}!'},"
                + "{'type':'FOOTER','text':'ignored'}]}");

    TemplateMessage message = TemplateMessage.from(template, List.of("Ann", "#42"));

    assertThat(message.text()).isEqualTo("Hi Ann\n\nYour order #42 has shipped. Thanks Ann!");
    assertThat(message.images()).isEmpty();
  }

  @Test
  void body_only_template_has_no_blank_header() throws Exception {
    JsonNode template =
        json("{'components':[{'type':'BODY','text':'Just the body'}]}");

    assertThat(TemplateMessage.from(template, List.of()).text()).isEqualTo("Just the body");
  }

  @Test
  void image_body_takes_listed_images() throws Exception {
    JsonNode template =
        json(
            "{'image1':'https://cdn/x.jpg','components':["
                + "{'type':'BODY','format':'IMAGE','text':'Look',"
                + "'images':['https://cdn/a.jpg','https://cdn/b.jpg']}]}");

    assertThat(TemplateMessage.from(template, List.of()).images())
        .containsExactly("https://cdn/a.jpg", "https://cdn/b.jpg");
  }

  @Test
  void image_body_falls_back_to_image_columns() throws Exception {
    JsonNode template =
        json(
            "{'image1':'https://cdn/1.jpg','image2':'','image3':'https://cdn/3.jpg',"
                + "'components':[{'type':'BODY','format':'IMAGE','text':'Look'}]}");

    assertThat(TemplateMessage.from(template, List.of()).images())
        .containsExactly("https://cdn/1.jpg", "https://cdn/3.jpg");
  }
}
